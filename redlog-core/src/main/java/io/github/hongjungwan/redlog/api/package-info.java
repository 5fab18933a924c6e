/**
 * Public API for redlog.
 *
 * <p>This package contains the types callers interact with directly.
 * Loggers are immutable: {@code withName} and {@code withField} return new
 * loggers and never modify the receiver, so a logger can be shared across
 * threads without synchronization.</p>
 *
 * <h2>Main Entry Points:</h2>
 * <ul>
 *   <li>{@link io.github.hongjungwan.redlog.api.Redlog} - Logger factory and global settings</li>
 *   <li>{@link io.github.hongjungwan.redlog.api.Logger} - Leveled emission and derivation</li>
 *   <li>{@link io.github.hongjungwan.redlog.api.field.Field} - Structured key=value attribute</li>
 *   <li>{@link io.github.hongjungwan.redlog.api.theme.Themes} - Built-in PLAIN and COLORIZED themes</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * Logger log = Redlog.getLogger("app");
 * Logger db = log.withName("db").withField("host", "db1");
 *
 * db.error("conn failed", Field.of("retry", 3));
 * // 14:03:07.412 [err] [app.db]     conn failed                                  host=db1 retry=3
 *
 * db.infof("pool size %d", 16);
 * }</pre>
 *
 * @since 0.1.0
 */
package io.github.hongjungwan.redlog.api;
