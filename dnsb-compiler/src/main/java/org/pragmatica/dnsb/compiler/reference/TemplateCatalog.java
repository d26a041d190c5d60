package org.pragmatica.dnsb.compiler.reference;

import org.pragmatica.dnsb.compiler.version.VersionRules;
import org.pragmatica.dnsb.config.ConfigLoader;
import org.pragmatica.dnsb.config.ConfigSource;
import org.pragmatica.dnsb.config.ConfigValue;
import org.pragmatica.dnsb.config.ConfigValue.Mapping;
import org.pragmatica.lang.Cause;
import org.pragmatica.lang.Option;
import org.pragmatica.lang.Result;

import java.util.List;

/**
 * Bundled image presets and service role templates.
 *
 * <p>Image presets are keyed by software type; service templates by software type and role.
 */
public final class TemplateCatalog {
    public static final String IMAGES_RESOURCE = "templates/images.yml";
    public static final String BUILDS_RESOURCE = "templates/builds.yml";
    public static final String RULES_RESOURCE = "templates/rules.yml";
    public static final String STD_QUALIFIER = "std";
    public static final String IMAGE = "image";

    private final Mapping imagePresets;
    private final Mapping serviceTemplates;
    private final VersionRules versionRules;

    private TemplateCatalog(Mapping imagePresets, Mapping serviceTemplates, VersionRules versionRules) {
        this.imagePresets = imagePresets;
        this.serviceTemplates = serviceTemplates;
        this.versionRules = versionRules;
    }

    public static TemplateCatalog templateCatalog(Mapping imagePresets, Mapping serviceTemplates) {
        return new TemplateCatalog(imagePresets, serviceTemplates, VersionRules.none());
    }

    public static TemplateCatalog templateCatalog(Mapping imagePresets, Mapping serviceTemplates, VersionRules versionRules) {
        return new TemplateCatalog(imagePresets, serviceTemplates, versionRules);
    }

    /**
     * Loads the catalog shipped on the classpath.
     */
    public static Result<TemplateCatalog> bundled() {
        return Result.all(ConfigLoader.loadDocument(ConfigSource.resource(IMAGES_RESOURCE)),
                          ConfigLoader.loadDocument(ConfigSource.resource(BUILDS_RESOURCE)),
                          ConfigLoader.loadDocument(ConfigSource.resource(RULES_RESOURCE))
                                      .flatMap(VersionRules::versionRules))
                     .map(TemplateCatalog::new);
    }

    /**
     * Preset for {@code software:version}; the version is written into the result.
     */
    public Option<Mapping> imagePreset(String reference) {
        var separator = reference.indexOf(':');
        if (separator <= 0) {
            return Option.none();
        }
        var software = reference.substring(0, separator);
        var version = reference.substring(separator + 1);
        return imagePresets.mapping(software)
                           .map(preset -> preset.with("version", ConfigValue.text(version)));
    }

    /**
     * Preset for {@code software:version} with the version rules of its software applied.
     */
    public Result<Mapping> versionedPreset(String image, String reference, Cause unknown) {
        return imagePreset(reference).toResult(unknown)
                                     .flatMap(preset -> versionRules.apply(image, preset));
    }

    public VersionRules versionRules() {
        return versionRules;
    }

    public Option<Mapping> serviceTemplate(String software, String role) {
        return serviceTemplates.mapping(software)
                               .flatMap(roles -> roles.mapping(role));
    }

    /**
     * Lookup for image {@code ref} values of the form {@code software:version}.
     */
    public ReferenceGraph.TemplateLookup imageTemplates() {
        return (owner, reference, definition) -> versionedPreset(owner,
                                                                 reference,
                                                                 new ReferenceError.UnknownTemplate(DefinitionKind.IMAGE,
                                                                                                    owner,
                                                                                                    reference));
    }

    /**
     * Lookup for service {@code ref} and {@code mixins} values of the form {@code software:role} or
     * {@code std:role}. The {@code std} form takes the software type from the service's own image.
     */
    public ReferenceGraph.TemplateLookup serviceTemplates(ImageIndex images) {
        return (owner, reference, definition) -> {
            var separator = reference.indexOf(':');
            var qualifier = reference.substring(0, separator);
            var role = reference.substring(separator + 1);
            var software = STD_QUALIFIER.equals(qualifier)
                           ? definition.text(IMAGE)
                                       .toResult(new ReferenceError.InvalidDefinition(DefinitionKind.SERVICE,
                                                                                      owner,
                                                                                      "ref '" + reference + "' requires the 'image' key"))
                                       .flatMap(image -> images.software(owner, image, "ref '" + reference + "'"))
                           : Result.success(qualifier);
            return software.flatMap(type -> serviceTemplate(type, role)
                .toResult(new ReferenceError.UnknownTemplate(DefinitionKind.SERVICE, owner, type + ":" + role)));
        };
    }

    public List<String> softwareTypes() {
        return imagePresets.keys();
    }
}
