/**
 * Encode/decode boundary for pending payloads.
 *
 * @see diffstore.codec.ValueCodec
 * @see diffstore.codec.Decoder
 */
package diffstore.codec;
