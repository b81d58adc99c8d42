/**
 * Per-sample pose log written as NDJSON.
 */
package ca.gc.cra.mimetic.infrastructure.poselog;
