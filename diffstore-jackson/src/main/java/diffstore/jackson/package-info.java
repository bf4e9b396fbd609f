/**
 * Jackson-backed {@link diffstore.codec.ValueCodec}.
 */
package diffstore.jackson;
