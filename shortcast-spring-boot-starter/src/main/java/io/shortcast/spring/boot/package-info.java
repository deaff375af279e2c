/**
 * Spring Boot auto-configuration for shortcast.
 *
 * <p>Binds {@code shortcast.*} properties, detects a JDBC state store on the application's
 * DataSource, bridges metrics to Micrometer, and runs the {@code --mode} command on startup.
 *
 * @see io.shortcast.spring.boot.ShortcastAutoConfiguration
 * @see io.shortcast.spring.boot.ShortcastProperties
 */
package io.shortcast.spring.boot;
