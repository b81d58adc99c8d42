/**
 * Thread and executor construction helpers.
 * <p>Every pipeline thread is named after its component and carries an uncaught-exception handler
 * that logs and counts failures.</p>
 */
package ca.gc.cra.mimetic.infrastructure.exec;
