/**
 * Notification sinks.
 */
package fr.lapetina.modeltraffic.infrastructure.notification;
