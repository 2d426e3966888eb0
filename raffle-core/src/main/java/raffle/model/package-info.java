/**
 * Domain records and status enums shared by the draw, broadcast and repository layers.
 *
 * <p>Status enums carry the lower-case code stored in the database and expose
 * {@code fromCode} for row mapping.
 */
package raffle.model;
