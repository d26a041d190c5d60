package org.pragmatica.dnsb.compiler.behavior;

/**
 * File produced by compilation, placed into the container at {@code containerPath}.
 */
public record GeneratedFile(String fileName, String containerPath, String content) {}
