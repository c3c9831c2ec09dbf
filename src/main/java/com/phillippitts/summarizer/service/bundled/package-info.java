/**
 * Lifecycle of the bundled completion server.
 *
 * <p>{@link com.phillippitts.summarizer.service.bundled.BundledProcessManager} spawns the server through
 * a {@link com.phillippitts.summarizer.service.bundled.ProcessFactory}, adopts a healthy server already
 * bound to the port, and records the PID of servers it owns in a marker file so a crashed run can be
 * cleaned up on the next start. Adopted servers are never signalled.
 */
package com.phillippitts.summarizer.service.bundled;
