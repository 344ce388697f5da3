/**
 * HTTP API: routing decisions, outcome reporting, registry inspection and rollout control.
 */
package fr.lapetina.modeltraffic.api;
