/**
 * Interfaces of the collaborators the controller consumes but does not implement itself:
 * deployment backend, smoke tests, notifications, durable storage, inference transport and
 * health probing.
 */
package fr.lapetina.modeltraffic.spi;
