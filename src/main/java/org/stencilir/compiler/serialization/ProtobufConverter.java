package org.stencilir.compiler.serialization;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.util.JsonFormat;
import org.stencilir.compiler.api.IrErrorCode;
import org.stencilir.compiler.api.MalformedEncodingException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A utility class for converting Protocol Buffers (Protobuf) messages to and from their binary and
 * JSON encodings.
 * <p>
 * JSON uses {@link JsonFormat}, so the output is compatible with the standard JSON mapping for
 * Protobuf. Parsing is strict: unknown JSON fields are rejected, and binary input is checked by
 * {@link OneofExclusivityChecker} before it is parsed.
 * <p>
 * Performance: {@link #fromJson(String, Class)} caches reflection lookups per message class
 * for O(1) access after first call.
 */
public final class ProtobufConverter {

    // Cache for newBuilder() methods to avoid repeated reflection lookups
    private static final ConcurrentHashMap<Class<?>, Method> builderMethodCache = new ConcurrentHashMap<>();

    private ProtobufConverter() {
        throw new IllegalStateException("Utility class");
    }

    /**
     * Converts a Protobuf message to its JSON representation.
     *
     * @param message The Protobuf message to convert.
     * @return A JSON string representing the message.
     * @throws IllegalStateException if the conversion fails.
     */
    public static String toJson(Message message) {
        try {
            return JsonFormat.printer().print(message);
        } catch (InvalidProtocolBufferException e) {
            throw new IllegalStateException("Failed to convert protobuf message to JSON.", e);
        }
    }

    /**
     * Converts a JSON string to a Protobuf message.
     * <p>
     * Performance: Caches the newBuilder() method lookup per message class.
     *
     * @param json The JSON string to convert
     * @param messageClass The class of the Protobuf message
     * @param <T> The type of the Protobuf message
     * @return The parsed Protobuf message
     * @throws MalformedEncodingException if the text is not valid JSON for the message type, or sets
     *         two branches of one oneof
     */
    public static <T extends Message> T fromJson(String json, Class<T> messageClass) throws MalformedEncodingException {
        Method method = builderMethodCache.computeIfAbsent(messageClass, clazz -> {
            try {
                return clazz.getMethod("newBuilder");
            } catch (NoSuchMethodException e) {
                throw new IllegalArgumentException("Protobuf message class must have newBuilder() method: " + clazz.getName(), e);
            }
        });

        Message.Builder builder;
        try {
            builder = (Message.Builder) method.invoke(null);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot create builder for " + messageClass.getName(), e);
        }

        try {
            JsonFormat.parser().merge(json, builder);
        } catch (InvalidProtocolBufferException e) {
            throw new MalformedEncodingException(IrErrorCode.MALFORMED_ENCODING,
                    "Failed to convert JSON to protobuf message " + messageClass.getSimpleName() + ": " + e.getMessage(), e);
        }

        @SuppressWarnings("unchecked")
        T result = (T) builder.build();
        return result;
    }

    /**
     * Parses the binary encoding of a message after checking that no oneof has more than one branch.
     *
     * @param bytes The encoded message.
     * @param prototype Any instance of the message type, usually the default instance.
     * @param <T> The type of the Protobuf message
     * @return The parsed message.
     * @throws MalformedEncodingException if the bytes do not parse, or a oneof has several branches
     */
    public static <T extends Message> T fromBytes(byte[] bytes, T prototype) throws MalformedEncodingException {
        OneofExclusivityChecker.check(bytes, prototype.getDescriptorForType());
        try {
            @SuppressWarnings("unchecked")
            T result = (T) prototype.getParserForType().parseFrom(bytes);
            return result;
        } catch (InvalidProtocolBufferException e) {
            throw new MalformedEncodingException(IrErrorCode.MALFORMED_ENCODING,
                    "Failed to parse " + prototype.getDescriptorForType().getName() + ": " + e.getMessage(), e);
        }
    }
}
