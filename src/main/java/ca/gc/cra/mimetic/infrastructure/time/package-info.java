/** Clock adapters. */
package ca.gc.cra.mimetic.infrastructure.time;
