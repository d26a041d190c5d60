package org.pragmatica.dnsb.compiler.reference;

import org.pragmatica.dnsb.config.ConfigValue.Mapping;
import org.pragmatica.lang.Result;

import java.util.Map;

/**
 * Looks up the resolved image a service points at. The reference is either a project image name
 * or a {@code software:version} preset.
 */
public final class ImageIndex {
    public static final String SOFTWARE = "software";

    private final Map<String, Mapping> images;
    private final TemplateCatalog catalog;

    private ImageIndex(Map<String, Mapping> images, TemplateCatalog catalog) {
        this.images = Map.copyOf(images);
        this.catalog = catalog;
    }

    public static ImageIndex imageIndex(Map<String, Mapping> resolvedImages, TemplateCatalog catalog) {
        return new ImageIndex(resolvedImages, catalog);
    }

    public Result<Mapping> image(String service, String reference) {
        var image = images.get(reference);
        if (image != null) {
            return Result.success(image);
        }
        if (reference.contains(":")) {
            return catalog.versionedPreset(reference, reference, new ReferenceError.UnknownImage(service, reference));
        }
        return new ReferenceError.UnknownImage(service, reference).result();
    }

    public Result<String> software(String service, String reference, String reason) {
        return image(service, reference).flatMap(image -> image.text(SOFTWARE)
                                                               .toResult(new ReferenceError.MissingSoftware(service,
                                                                                                           reference,
                                                                                                           reason)));
    }
}
