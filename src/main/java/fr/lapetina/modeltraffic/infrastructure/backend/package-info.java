/**
 * Built-in {@link fr.lapetina.modeltraffic.spi.DeploymentBackend} for statically provisioned servers.
 */
package fr.lapetina.modeltraffic.infrastructure.backend;
