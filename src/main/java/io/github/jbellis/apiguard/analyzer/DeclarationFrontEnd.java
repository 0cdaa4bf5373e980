package io.github.jbellis.apiguard.analyzer;

import java.nio.file.Path;
import java.util.List;

/**
 * Turns source files into syntax trees and a symbol table.
 */
public interface DeclarationFrontEnd {

    /**
     * Parses the root files and every file they reference that the config allows to be followed. Files that
     * cannot be read are left out of the program rather than failing the call.
     */
    Program createProgram(List<Path> rootNames, FrontEndConfig config);
}
