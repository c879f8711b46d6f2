package me.christianrobert.pyibackport.transformer.catalog;

import me.christianrobert.pyibackport.transformer.model.ModuleSymbol;
import me.christianrobert.pyibackport.transformer.model.PythonVersion;

/**
 * A symbol that has to be spelled differently when the target predates a given version.
 * <p>
 * Example: {@code typing.override} requires 3.12; for older targets it is relocated to
 * {@code typing_extensions.override}.
 */
public class BackportRequirement {
    private final ModuleSymbol source;        // e.g., typing.override
    private final PythonVersion minVersion;   // first version where source is usable
    private final ModuleSymbol relocation;    // e.g., typing_extensions.override
    private final BackportKind kind;
    private final boolean relocatedToAttribute; // relocation module ends in a class, not a module
    private final String notes;

    private BackportRequirement(Builder builder) {
        this.source = builder.source;
        this.minVersion = builder.minVersion;
        this.relocation = builder.relocation;
        this.kind = builder.kind;
        this.relocatedToAttribute = builder.relocatedToAttribute;
        this.notes = builder.notes;
    }

    /**
     * Whether code for {@code target} must use the relocation instead of the source symbol.
     */
    public boolean isActiveFor(PythonVersion target) {
        return target.isBefore(minVersion);
    }

    // Getters

    public ModuleSymbol getSource() {
        return source;
    }

    public PythonVersion getMinVersion() {
        return minVersion;
    }

    public ModuleSymbol getRelocation() {
        return relocation;
    }

    public BackportKind getKind() {
        return kind;
    }

    /**
     * True when the relocation is an attribute of a class ({@code datetime.timezone.utc}), so it
     * has to be imported through the class rather than from the "module" part.
     */
    public boolean isRelocatedToAttribute() {
        return relocatedToAttribute;
    }

    public String getNotes() {
        return notes;
    }

    @Override
    public String toString() {
        return source + " -> " + relocation + " (before " + minVersion + ")";
    }

    // Builder

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ModuleSymbol source;
        private PythonVersion minVersion = PythonVersion.NEVER;
        private ModuleSymbol relocation;
        private BackportKind kind = BackportKind.STDLIB_RELOCATION;
        private boolean relocatedToAttribute;
        private String notes;

        public Builder source(String module, String symbol) {
            this.source = new ModuleSymbol(module, symbol);
            return this;
        }

        public Builder minVersion(PythonVersion minVersion) {
            this.minVersion = minVersion;
            return this;
        }

        public Builder relocation(String module, String symbol) {
            this.relocation = new ModuleSymbol(module, symbol);
            return this;
        }

        public Builder kind(BackportKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder relocatedToAttribute(boolean relocatedToAttribute) {
            this.relocatedToAttribute = relocatedToAttribute;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public BackportRequirement build() {
            if (source == null || relocation == null) {
                throw new IllegalStateException("Backport requirement needs a source and a relocation");
            }
            return new BackportRequirement(this);
        }
    }
}
