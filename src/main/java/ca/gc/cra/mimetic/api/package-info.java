/**
 * Command-line entry points: the {@code mimetic} dispatcher plus the {@code run} and
 * {@code calibrate} commands. Commands return an {@link ca.gc.cra.mimetic.api.ExitCode} and only the
 * {@code main} methods call {@link System#exit(int)}.
 */
package ca.gc.cra.mimetic.api;
