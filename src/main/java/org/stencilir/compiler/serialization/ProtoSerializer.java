package org.stencilir.compiler.serialization;

import com.google.protobuf.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stencilir.compiler.api.InvariantViolationException;
import org.stencilir.compiler.api.IrErrorCode;
import org.stencilir.compiler.api.MalformedEncodingException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Base class of the serializers of one IR entity type. Subclasses map the entity to and from its
 * protobuf message; this class handles both encodings and files.
 * <p>
 * Instances are stateless and may be shared between threads.
 *
 * @param <T> The model type.
 * @param <M> The protobuf message type.
 */
public abstract class ProtoSerializer<T, M extends Message> {

    private static final Logger LOG = LoggerFactory.getLogger(ProtoSerializer.class);

    private final M prototype;
    private final Class<M> messageClass;
    private final SerializationFormat defaultFormat;
    private final boolean validateOnRead;

    /**
     * @param prototype The default instance of the message type.
     * @param messageClass The message class.
     * @param defaultFormat The encoding of the methods that take no format.
     * @param validateOnRead Whether {@link #deserialize(byte[], SerializationFormat)} validates what it decodes.
     */
    protected ProtoSerializer(M prototype, Class<M> messageClass, SerializationFormat defaultFormat, boolean validateOnRead) {
        this.prototype = Objects.requireNonNull(prototype, "prototype");
        this.messageClass = Objects.requireNonNull(messageClass, "messageClass");
        this.defaultFormat = Objects.requireNonNull(defaultFormat, "defaultFormat");
        this.validateOnRead = validateOnRead;
    }

    /**
     * Maps a model value to its message.
     * @param value The value.
     * @return The message.
     */
    public abstract M toProto(T value);

    /**
     * Maps a message to a model value.
     * @param proto The message.
     * @return The value.
     * @throws MalformedEncodingException if the message does not describe a model value
     */
    public abstract T fromProto(M proto) throws MalformedEncodingException;

    /**
     * Checks the invariants of a decoded value. Does nothing unless overridden.
     * @param value The decoded value.
     * @throws InvariantViolationException if the value violates an invariant
     */
    protected void validate(T value) {
    }

    public boolean isValidateOnRead() {
        return validateOnRead;
    }

    public SerializationFormat getDefaultFormat() {
        return defaultFormat;
    }

    /**
     * Encodes a value in the default format.
     * @param value The value.
     * @return The encoded bytes.
     */
    public byte[] serialize(T value) {
        return serialize(value, defaultFormat);
    }

    /**
     * Decodes a value encoded in the default format.
     * @param bytes The encoded bytes.
     * @return The value.
     * @throws MalformedEncodingException if the bytes are not a valid encoding of a value
     */
    public T deserialize(byte[] bytes) throws MalformedEncodingException {
        return deserialize(bytes, defaultFormat);
    }

    /**
     * Encodes a value.
     * @param value The value.
     * @param format The encoding.
     * @return The encoded bytes; JSON is UTF-8.
     */
    public byte[] serialize(T value, SerializationFormat format) {
        M proto = toProto(value);
        byte[] bytes = switch (format) {
            case BYTE -> proto.toByteArray();
            case JSON -> ProtobufConverter.toJson(proto).getBytes(StandardCharsets.UTF_8);
        };
        LOG.debug("Encoded {} as {} ({} bytes)", messageClass.getSimpleName(), format, bytes.length);
        return bytes;
    }

    /**
     * Decodes a value.
     * @param bytes The encoded bytes.
     * @param format The encoding.
     * @return The value.
     * @throws MalformedEncodingException if the bytes are not a valid encoding of a value
     * @throws InvariantViolationException if validation on read is enabled and the value violates an invariant
     */
    public T deserialize(byte[] bytes, SerializationFormat format) throws MalformedEncodingException {
        M proto = switch (format) {
            case BYTE -> ProtobufConverter.fromBytes(bytes, prototype);
            case JSON -> ProtobufConverter.fromJson(new String(bytes, StandardCharsets.UTF_8), messageClass);
        };
        T value;
        try {
            value = fromProto(proto);
        } catch (IllegalArgumentException e) {
            throw new MalformedEncodingException(IrErrorCode.MALFORMED_ENCODING,
                    "Invalid " + messageClass.getSimpleName() + ": " + e.getMessage(), e);
        }
        if (validateOnRead) {
            validate(value);
        }
        LOG.debug("Decoded {} from {} ({} bytes)", messageClass.getSimpleName(), format, bytes.length);
        return value;
    }

    /**
     * Encodes a value into a file, replacing its content.
     * @param value The value.
     * @param file The file.
     * @param format The encoding.
     * @throws IOException if the file cannot be written
     */
    public void serializeToFile(T value, Path file, SerializationFormat format) throws IOException {
        Files.write(file, serialize(value, format));
        LOG.info("Wrote {} to {}", messageClass.getSimpleName(), file);
    }

    /**
     * Decodes a value from a file.
     * @param file The file.
     * @param format The encoding.
     * @return The value.
     * @throws IOException if the file cannot be read
     * @throws MalformedEncodingException if the content is not a valid encoding of a value
     */
    public T deserializeFromFile(Path file, SerializationFormat format) throws IOException, MalformedEncodingException {
        return deserialize(Files.readAllBytes(file), format);
    }

    public void serializeToFile(T value, Path file) throws IOException {
        serializeToFile(value, file, defaultFormat);
    }

    public T deserializeFromFile(Path file) throws IOException, MalformedEncodingException {
        return deserializeFromFile(file, defaultFormat);
    }
}
