package org.stencilir.compiler.serialization;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.Descriptors.OneofDescriptor;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.WireFormat;
import org.stencilir.compiler.api.IrErrorCode;
import org.stencilir.compiler.api.MalformedEncodingException;
import org.stencilir.compiler.api.UnknownVariantException;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Rejects binary input in which one message instance carries more than one branch of a oneof.
 * <p>
 * The protobuf parser silently keeps the last branch it reads, so the check runs on the raw bytes
 * before parsing. Messages that consist of nothing but one oneof (the statement, expression and
 * stencil-function argument unions) also reject unknown field numbers, which would otherwise parse
 * as a union with no branch or be dropped.
 */
final class OneofExclusivityChecker {

    private OneofExclusivityChecker() {
        throw new IllegalStateException("Utility class");
    }

    /**
     * @param bytes The encoded message.
     * @param descriptor The descriptor of the top-level message type.
     * @throws UnknownVariantException if a oneof has several branches or a union an unknown branch
     * @throws MalformedEncodingException if the bytes are not a valid encoding
     */
    static void check(byte[] bytes, Descriptor descriptor) throws MalformedEncodingException {
        CodedInputStream in = CodedInputStream.newInstance(bytes);
        try {
            checkMessage(in, descriptor);
        } catch (InvalidProtocolBufferException e) {
            throw new MalformedEncodingException(IrErrorCode.MALFORMED_ENCODING,
                    "Invalid encoding of " + descriptor.getName() + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MalformedEncodingException(IrErrorCode.MALFORMED_ENCODING,
                    "Cannot read encoding of " + descriptor.getName(), e);
        }
    }

    private static void checkMessage(CodedInputStream in, Descriptor descriptor) throws IOException, MalformedEncodingException {
        Map<OneofDescriptor, Integer> branches = new HashMap<>();
        boolean union = isUnion(descriptor);
        for (int tag = in.readTag(); tag != 0; tag = in.readTag()) {
            int number = WireFormat.getTagFieldNumber(tag);
            FieldDescriptor field = descriptor.findFieldByNumber(number);
            if (field == null) {
                if (union) {
                    throw new UnknownVariantException(descriptor.getName(), "unknown branch with field number " + number);
                }
                in.skipField(tag);
                continue;
            }

            OneofDescriptor oneof = field.getContainingOneof();
            if (oneof != null) {
                Integer previous = branches.put(oneof, number);
                if (previous != null && previous != number) {
                    throw new UnknownVariantException(descriptor.getName() + "." + oneof.getName(),
                            "branches " + previous + " and " + number + " are both present");
                }
            }

            if (field.getJavaType() == FieldDescriptor.JavaType.MESSAGE
                    && WireFormat.getTagWireType(tag) == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                int length = in.readRawVarint32();
                int oldLimit = in.pushLimit(length);
                checkMessage(in, field.getMessageType());
                in.popLimit(oldLimit);
            } else {
                in.skipField(tag);
            }
        }
    }

    private static boolean isUnion(Descriptor descriptor) {
        return !descriptor.getOneofs().isEmpty()
                && descriptor.getFields().stream().allMatch(f -> f.getContainingOneof() != null);
    }
}
