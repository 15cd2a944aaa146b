package org.yangtree.compiler.resolve.passes;

import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.resolve.IResolutionPass;
import org.yangtree.compiler.resolve.ResolutionContext;
import org.yangtree.compiler.types.BuiltinTypes;
import org.yangtree.compiler.types.PrimitiveType;
import org.yangtree.compiler.types.RangeNormalizer;
import org.yangtree.compiler.types.YangType;
import org.yangtree.compiler.types.YangTypes;

/**
 * Pass 6: rewrites every range and length restriction into canonical numeric form.
 */
public final class RangeNormalizationPass implements IResolutionPass {

    @Override
    public String name() {
        return "range-normalization";
    }

    @Override
    public void apply(ResolutionContext context) {
        context.getRoot().walk(node -> {
            if (node.getType() == null) {
                return;
            }
            try {
                node.setType(YangTypes.rewrite(node.getType(), RangeNormalizationPass::normalize));
            } catch (ModelProcessingException e) {
                throw new ModelProcessingException(e.getMessage() + " in " + node.describe(), e);
            }
        });
    }

    private static YangType normalize(YangType type) {
        if (!(type instanceof PrimitiveType primitive)) {
            return type;
        }
        PrimitiveType result = primitive;
        if (primitive.range() != null) {
            if (!BuiltinTypes.hasRange(primitive.name())) {
                throw new ModelProcessingException("Type '" + primitive.name() + "' does not take a range restriction");
            }
            result = result.withRange(RangeNormalizer.normalizeRange(primitive.range(), primitive.name(),
                    primitive.fractionDigits()));
        }
        if (primitive.length() != null) {
            if (!BuiltinTypes.hasLength(primitive.name())) {
                throw new ModelProcessingException("Type '" + primitive.name() + "' does not take a length restriction");
            }
            result = result.withLength(RangeNormalizer.normalizeLength(primitive.length()));
        }
        return result;
    }
}
