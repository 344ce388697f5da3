/**
 * {@link fr.lapetina.modeltraffic.spi.SnapshotStore} implementations: in-memory and JSON files.
 */
package fr.lapetina.modeltraffic.infrastructure.store;
