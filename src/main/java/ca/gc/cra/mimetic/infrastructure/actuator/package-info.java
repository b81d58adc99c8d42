/**
 * HTTP actuator adapter and the JSON wire format it posts.
 */
package ca.gc.cra.mimetic.infrastructure.actuator;
