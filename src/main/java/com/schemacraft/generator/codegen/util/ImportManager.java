package com.schemacraft.generator.codegen.util;

import java.util.Set;
import java.util.TreeSet;

/**
 * Collects import statements for a generated Java class.
 *
 * Imports render in two sorted blocks, library imports first and {@code java.*} last,
 * so the same set of imports always renders the same way.
 */
public class ImportManager {

    private final Set<String> libraryImports = new TreeSet<>();
    private final Set<String> javaImports = new TreeSet<>();
    private final String currentPackage;

    public ImportManager(String currentPackage) {
        this.currentPackage = currentPackage;
    }

    /**
     * Adds an import for a fully qualified class name.
     * Skips java.lang, the current package and names without a package.
     */
    public ImportManager addImport(String fullQualifiedName) {
        if (fullQualifiedName == null || fullQualifiedName.isEmpty()) {
            return this;
        }
        String packageName = getPackageName(fullQualifiedName);
        if (packageName.isEmpty() || packageName.equals("java.lang") || packageName.equals(currentPackage)) {
            return this;
        }
        if (fullQualifiedName.startsWith("java.")) {
            javaImports.add(fullQualifiedName);
        } else {
            libraryImports.add(fullQualifiedName);
        }
        return this;
    }

    public ImportManager addImports(Iterable<String> fullQualifiedNames) {
        for (String fqn : fullQualifiedNames) {
            addImport(fqn);
        }
        return this;
    }

    /**
     * Renders the import block, ending with a newline, or an empty string when there is nothing to import.
     */
    public String generateImports() {
        StringBuilder sb = new StringBuilder();
        appendBlock(sb, libraryImports);
        if (!libraryImports.isEmpty() && !javaImports.isEmpty()) {
            sb.append('\n');
        }
        appendBlock(sb, javaImports);
        return sb.toString();
    }

    private static void appendBlock(StringBuilder sb, Set<String> imports) {
        for (String imp : imports) {
            sb.append("import ").append(imp).append(";\n");
        }
    }

    private static String getPackageName(String fullQualifiedName) {
        int lastDot = fullQualifiedName.lastIndexOf('.');
        if (lastDot < 0) {
            return "";
        }
        return fullQualifiedName.substring(0, lastDot);
    }
}
