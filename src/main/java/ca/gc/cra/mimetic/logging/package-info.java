/**
 * Logging helpers layered over SLF4J and Logback.
 * <p>Pipeline workers tag their thread with the {@code pipeline} MDC key; the console pattern in
 * {@code logback.xml} prints it.</p>
 */
package ca.gc.cra.mimetic.logging;
