package com.raditha.merge.signature;

import com.raditha.merge.model.Node;
import com.raditha.merge.model.Signature;

/**
 * Default identity keys. Names, conditions and call targets are part of the
 * key; bodies and assigned values are not, so that a changed method body or
 * constant value still pairs with its counterpart.
 */
public class DefaultSignatureGenerator implements SignatureGenerator {

    @Override
    public Signature signature(Node node) {
        if (node == null) {
            return null;
        }
        return switch (node.kind()) {
            case DEFINITION -> Signature.of("definition", node.name(), node.parameters());
            case TYPE_DECLARATION -> Signature.of(node.keyword(), node.name());
            case INITIALIZER -> Signature.of("initializer", node.keyword());
            case CALL -> Signature.of("call", node.discriminant());
            case CONDITIONAL, LOOP -> Signature.of(node.keyword(), node.discriminant());
            case TRY -> Signature.of("try", node.discriminant());
            case CONSTANT -> Signature.of("const_assign", node.name());
            case VARIABLE -> Signature.of(node.keyword(), node.name());
            case LITERAL -> null;
            case COMMENT -> "directive".equals(node.keyword())
                    ? Signature.of("comment", "directive", node.discriminant())
                    : Signature.of("comment", node.discriminant());
            case PACKAGE -> Signature.of("package");
            case IMPORT -> Signature.of("import", node.discriminant());
            case FREEZE_BLOCK -> Signature.of("freeze_block", node.discriminant());
            case OTHER -> node.discriminant() == null
                    ? Signature.of(node.keyword())
                    : Signature.of(node.keyword(), node.discriminant());
        };
    }
}
