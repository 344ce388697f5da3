/**
 * Endpoint selection.
 *
 * <p>A request is first assigned a model version by the deterministic traffic split, then the
 * configured strategy picks one healthy endpoint of that version.
 */
package fr.lapetina.modeltraffic.routing;
