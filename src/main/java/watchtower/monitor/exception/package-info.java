/**
 * Monitoring-core exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link watchtower.monitor.exception.WatchtowerException} - Base unchecked exception</li>
 *   <li>{@link watchtower.monitor.exception.InvalidScheduleException} - Schedule string could not
 *       be parsed; the owning entity is skipped for the cycle</li>
 *   <li>{@link watchtower.monitor.exception.StoreException} - JDBC failure in the store layer</li>
 *   <li>{@link watchtower.monitor.exception.SendException} - Delivery target failed; recorded on the
 *       alert record and contained per target</li>
 * </ul>
 *
 * <p>{@link watchtower.monitor.exception.RateLimitExceededException} stands apart as a checked
 * exception. It carries the target, the detection and the refusing tier index.
 */
package watchtower.monitor.exception;
