/**
 * Spring Boot auto-configuration, properties and HTTP endpoints for the outreach engine.
 */
package outreach.spring.boot;
