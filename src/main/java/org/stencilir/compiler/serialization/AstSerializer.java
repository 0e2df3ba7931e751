package org.stencilir.compiler.serialization;

import org.stencilir.compiler.api.MalformedEncodingException;
import org.stencilir.compiler.ast.Stmt;
import org.stencilir.compiler.proto.statements.StatementsProto;

/**
 * Serializes a standalone AST, i.e. a root statement, as the {@code AST} message.
 */
public class AstSerializer extends ProtoSerializer<Stmt, StatementsProto.AST> {

    public AstSerializer() {
        super(StatementsProto.AST.getDefaultInstance(), StatementsProto.AST.class, SerializationFormat.BYTE, false);
    }

    @Override
    public StatementsProto.AST toProto(Stmt root) {
        return AstProtoCodec.encodeAst(root);
    }

    @Override
    public Stmt fromProto(StatementsProto.AST proto) throws MalformedEncodingException {
        return AstProtoCodec.decodeAst(proto);
    }
}
