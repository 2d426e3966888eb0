/**
 * Small shared helpers: hashing and thread naming.
 */
package raffle.util;
