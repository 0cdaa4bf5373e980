package io.github.jbellis.apiguard.serializer;

import java.nio.file.Path;

/**
 * Hard failures of public API rendering. Soft problems (a symbol without a declaration, a re-export that cannot
 * be followed) are reported through a {@link DiagnosticSink} instead.
 */
public sealed class ApiSerializationException extends RuntimeException {
    private ApiSerializationException(String message) {
        super(message);
    }

    /** Thrown when the entry point is not a {@code .d.ts} file. Checked before anything is parsed. */
    public static final class NotADeclarationFileException extends ApiSerializationException {
        public NotADeclarationFileException(String fileName) {
            super("Source file \"%s\" is not a declaration file".formatted(fileName));
        }
    }

    /** Thrown when the entry point did not end up among the parsed files, e.g. because it does not exist. */
    public static final class EntryFileNotFoundException extends ApiSerializationException {
        public EntryFileNotFoundException(Path path) {
            super("Source file \"%s\" not found".formatted(path));
        }
    }

    /** Thrown when an exported declaration refers to a namespace qualifier that has not been allowed. */
    public static final class UnlistedModuleIdentifierException extends ApiSerializationException {
        private final String fileName;
        private final int line;
        private final int column;
        private final String identifier;

        public UnlistedModuleIdentifierException(String fileName, int line, int column, String identifier) {
            super(("%s(%d,%d): error: Module identifier \"%s\" is not allowed. Remove it from source or "
                   + "whitelist it via --allowModuleIdentifiers.").formatted(fileName, line, column, identifier));
            this.fileName = fileName;
            this.line = line;
            this.column = column;
            this.identifier = identifier;
        }

        public String fileName() {
            return fileName;
        }

        /** 1-based */
        public int line() {
            return line;
        }

        /** 1-based */
        public int column() {
            return column;
        }

        public String identifier() {
            return identifier;
        }
    }

    /** Thrown when an export renames the symbol it re-exports, which the rendered text could not show. */
    public static final class AliasRenamedException extends ApiSerializationException {
        private final String aliasName;
        private final String targetName;

        public AliasRenamedException(String aliasName, String targetName) {
            super("Symbol \"%s\" was aliased as \"%s\". Aliases are not supported.".formatted(targetName, aliasName));
            this.aliasName = aliasName;
            this.targetName = targetName;
        }

        public String aliasName() {
            return aliasName;
        }

        public String targetName() {
            return targetName;
        }
    }
}
