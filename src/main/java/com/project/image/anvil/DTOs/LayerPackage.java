package com.project.image.anvil.DTOs;

import java.util.ArrayList;
import java.util.List;

/**
 * Editable export: the stack (bottom to top), the flattened composite and metadata.
 * Every layer has the same pixel dimensions.
 */
public record LayerPackage(List<Layer> stack, Layer composite, LayerMetadata metadata) {

    public LayerPackage {
        stack = List.copyOf(stack);
    }

    /** Stack layers followed by the composite. */
    public List<Layer> layers() {
        List<Layer> all = new ArrayList<>(stack);
        all.add(composite);
        return all;
    }

    public record Layer(String name, String fileName, BlendMode blendMode, byte[] png, String description) {
    }
}
