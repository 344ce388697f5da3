/**
 * LMAX Disruptor request pipeline.
 *
 * <h2>Stages</h2>
 * <ol>
 *   <li>{@link fr.lapetina.modeltraffic.disruptor.handlers.RouteSelectionHandler} - version split and strategy</li>
 *   <li>{@link fr.lapetina.modeltraffic.disruptor.handlers.DispatchHandler} - asynchronous call to the endpoint</li>
 *   <li>{@link fr.lapetina.modeltraffic.disruptor.handlers.MetricsHandler} - counters, stage timings, MDC</li>
 *   <li>{@link fr.lapetina.modeltraffic.disruptor.handlers.CompletionHandler} - summary logging, event reuse</li>
 * </ol>
 *
 * <p>Events are pre-allocated and reused. Nothing may hold a reference to a
 * {@link fr.lapetina.modeltraffic.domain.event.RoutingEvent} beyond its handler invocation.
 */
package fr.lapetina.modeltraffic.disruptor;
