/**
 * Typed, one-way event notifications with a static dispatch table.
 *
 * @see raffle.event.EventDispatcher
 * @see raffle.event.RaffleEvent
 */
package raffle.event;
