/**
 * Service Provider Interfaces (SPI) for redlog.
 *
 * <p>Implement these interfaces to customize where and how lines are rendered:</p>
 *
 * <ul>
 *   <li>{@link io.github.hongjungwan.redlog.spi.Sink} - Output destination</li>
 *   <li>{@link io.github.hongjungwan.redlog.spi.Formatter} - Line layout</li>
 *   <li>{@link io.github.hongjungwan.redlog.spi.ColorSupport} - Terminal color capability check</li>
 * </ul>
 *
 * <h2>Installation:</h2>
 * <pre>{@code
 * Redlog.setSink(new FileSink(Path.of("app.log")));
 * Redlog.setFormatter(new JsonFormatter());
 * }</pre>
 *
 * @since 0.1.0
 */
package io.github.hongjungwan.redlog.spi;
