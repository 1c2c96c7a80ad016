/**
 * Configuration loading and hot-reload support.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.sessionpool.infrastructure.config.SessionPoolConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.sessionpool.infrastructure.config.ConfigLoader} - YAML loading, environment overrides and file watching</li>
 *   <li>{@link fr.lapetina.sessionpool.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Hot-Reload</h2>
 * <p>Only the pacing profile and the idle timeout are applied live; other sections
 * take effect on restart.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code pool} - Hard and soft worker caps, pre-warmed workers, idle timeout</li>
 *   <li>{@code scheduler} - Tick interval and cleanup cadence</li>
 *   <li>{@code timeouts} - Page-load, control-wait, artifact and auth-probe timeouts</li>
 *   <li>{@code auth} - Identity flow attempts, status cache TTL, credentials</li>
 *   <li>{@code stuckDetection} - Working-indicator polling and reload cycles</li>
 *   <li>{@code interaction} - Primary and secondary control retry budgets</li>
 *   <li>{@code pacing} - Pacing profile name</li>
 *   <li>{@code surface} - Target locations and control selectors</li>
 *   <li>{@code storage} - Download and upload directories</li>
 *   <li>{@code browser} - Browser launch options</li>
 *   <li>{@code metrics} - Metric name prefix</li>
 *   <li>{@code statusLog} - Launcher status log interval</li>
 * </ul>
 */
package fr.lapetina.sessionpool.infrastructure.config;
