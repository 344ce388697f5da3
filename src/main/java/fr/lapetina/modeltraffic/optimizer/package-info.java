/**
 * Baseline capture and degradation analysis.
 */
package fr.lapetina.modeltraffic.optimizer;
