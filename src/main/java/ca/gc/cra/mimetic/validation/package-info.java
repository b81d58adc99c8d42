/**
 * Input validation shared by configuration parsing and the CLI.
 * <p>All helpers are stateless and throw {@link java.lang.IllegalArgumentException} with operator-facing
 * messages.</p>
 */
package ca.gc.cra.mimetic.validation;
