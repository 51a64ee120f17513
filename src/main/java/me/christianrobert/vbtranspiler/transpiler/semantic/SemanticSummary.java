package me.christianrobert.vbtranspiler.transpiler.semantic;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flat, line-anchored inventory of declared classes, methods and properties.
 *
 * <p>Entries are in source order. Duplicate names are kept as separate entries: the summary is a
 * trace of declarations, not a symbol table. Instances are rebuilt for every request and cannot
 * be changed once built.</p>
 */
public class SemanticSummary {

    private final List<ClassEntry> classes;
    private final List<MethodEntry> methods;
    private final List<PropertyEntry> properties;

    private SemanticSummary(Builder builder) {
        this.classes = Collections.unmodifiableList(new ArrayList<>(builder.classes));
        this.methods = Collections.unmodifiableList(new ArrayList<>(builder.methods));
        this.properties = Collections.unmodifiableList(new ArrayList<>(builder.properties));
    }

    public static SemanticSummary empty() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ClassEntry> getClasses() {
        return classes;
    }

    public List<MethodEntry> getMethods() {
        return methods;
    }

    public List<PropertyEntry> getProperties() {
        return properties;
    }

    public boolean isEmpty() {
        return classes.isEmpty() && methods.isEmpty() && properties.isEmpty();
    }

    @Override
    public String toString() {
        return "SemanticSummary{classes=" + classes.size() + ", methods=" + methods.size()
                + ", properties=" + properties.size() + "}";
    }

    public static class ClassEntry {
        private final String name;
        private final int line;

        public ClassEntry(String name, int line) {
            this.name = name;
            this.line = line;
        }

        public String getName() {
            return name;
        }

        public int getLine() {
            return line;
        }
    }

    public static class MethodEntry {
        private final String name;
        private final int line;
        private final String returnType;

        public MethodEntry(String name, int line, String returnType) {
            this.name = name;
            this.line = line;
            this.returnType = returnType;
        }

        public String getName() {
            return name;
        }

        public int getLine() {
            return line;
        }

        /**
         * @return Declared return type, null for VB Subs, constructors and undeclared types
         */
        @JsonProperty("return_type")
        public String getReturnType() {
            return returnType;
        }
    }

    public static class PropertyEntry {
        private final String name;
        private final int line;
        private final String type;

        public PropertyEntry(String name, int line, String type) {
            this.name = name;
            this.line = line;
            this.type = type;
        }

        public String getName() {
            return name;
        }

        public int getLine() {
            return line;
        }

        public String getType() {
            return type;
        }
    }

    public static class Builder {
        private final List<ClassEntry> classes = new ArrayList<>();
        private final List<MethodEntry> methods = new ArrayList<>();
        private final List<PropertyEntry> properties = new ArrayList<>();

        public Builder addClass(String name, int line) {
            classes.add(new ClassEntry(name, line));
            return this;
        }

        public Builder addMethod(String name, int line, String returnType) {
            methods.add(new MethodEntry(name, line, returnType));
            return this;
        }

        public Builder addProperty(String name, int line, String type) {
            properties.add(new PropertyEntry(name, line, type));
            return this;
        }

        public SemanticSummary build() {
            return new SemanticSummary(this);
        }
    }
}
