package xml.java17.xmlmap;

import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// A model type: the fields bound to one kind of element, plus how to create such an element.
///
/// Types are built once and are immutable afterwards. A type inherits the fields and settings of
/// the types it extends; later parents shadow earlier ones and the type's own declarations
/// shadow all of them.
///
/// ```java
/// XmlObjectType person = XmlObjectType.builder("Person")
///     .rootName("person")
///     .rootNamespace("urn:example:people")
///     .namespace("p", "urn:example:people")
///     .field("name", Fields.string("p:name"))
///     .field("friends", Fields.selfNodeList("p:friend"))
///     .build();
/// XmlObject alice = person.create(Map.of("name", "Alice"));
/// ```
public final class XmlObjectType {

    private static final Logger LOG = Logger.getLogger(XmlObjectType.class.getName());

    /// The generic type with no fields, used for transform results and plain wrapping.
    public static final XmlObjectType BASE = builder("XmlObject").build();

    private final String name;
    private final String rootName;
    private final String rootNamespace;
    private final Map<String, String> namespaces;
    private final String xsdSchema;
    private final boolean schemaValidate;
    private final XmlObjectFactory factory;
    private final Map<String, XmlField<?, ?>> fields;

    private XmlObjectType(Builder builder, Map<String, XmlField<?, ?>> fields) {
        this.name = builder.name;
        this.rootName = builder.rootName;
        this.rootNamespace = builder.rootNamespace;
        this.namespaces = Map.copyOf(builder.namespaces);
        this.xsdSchema = builder.xsdSchema;
        this.schemaValidate = builder.schemaValidate == null || builder.schemaValidate;
        this.factory = builder.factory == null ? XmlObject::new : builder.factory;
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    /// Element name for new documents; null when the type cannot be created from scratch.
    public String rootName() {
        return rootName;
    }

    public String rootNamespace() {
        return rootNamespace;
    }

    public Map<String, String> namespaces() {
        return namespaces;
    }

    /// XSD location used for validation and schema fields; null when none is declared.
    public String xsdSchema() {
        return xsdSchema;
    }

    public boolean schemaValidate() {
        return schemaValidate;
    }

    /// All fields, own and inherited, in declaration order.
    public Map<String, XmlField<?, ?>> fields() {
        return fields;
    }

    /// @throws IllegalArgumentException if the type has no such field
    public XmlField<?, ?> field(String fieldName) {
        final var field = fields.get(fieldName);
        if (field == null) {
            throw new IllegalArgumentException(name + " has no field '" + fieldName + "'");
        }
        return field;
    }

    /// Namespace bindings declared by the type.
    public XmlContext context() {
        return XmlContext.of(namespaces);
    }

    /// Creates a new document whose root element is this type's root, declaring the type's namespaces.
    /// @throws IllegalStateException if the type has no root name
    public XmlObject create() {
        if (rootName == null) {
            throw new IllegalStateException(name + " has no root name, cannot create a new document");
        }
        final var document = XmlDocuments.newDocument();
        final var prefix = rootNamespace == null ? null : prefixFor(rootNamespace);
        final var qualifiedName = prefix == null ? rootName : prefix + ":" + rootName;
        final var root = document.createElementNS(rootNamespace, qualifiedName);
        for (final var declaration : context().declarations()) {
            root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI,
                    XMLConstants.XMLNS_ATTRIBUTE + ":" + declaration.getKey(), declaration.getValue());
        }
        document.appendChild(root);
        LOG.fine(() -> "Created new " + name + " document <" + qualifiedName + ">");
        return wrap(root);
    }

    /// Creates a new document and sets the given fields on it in iteration order.
    public XmlObject create(Map<String, ?> initialValues) {
        Objects.requireNonNull(initialValues, "initialValues must not be null");
        final var object = create();
        initialValues.forEach(object::set);
        return object;
    }

    public XmlObject wrap(Element node) {
        return wrap(node, XmlContext.EMPTY);
    }

    /// Wraps an existing element. Namespace bindings come from the element's in-scope
    /// declarations, overridden by the caller's context, overridden by the type's own map.
    public XmlObject wrap(Element node, XmlContext callerContext) {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(callerContext, "callerContext must not be null");
        final var context = XmlContext.fromNode(node).merge(callerContext).merge(context());
        return factory.create(this, node, context);
    }

    private String prefixFor(String uri) {
        return namespaces.entrySet().stream()
                .filter(e -> e.getValue().equals(uri))
                .map(Map.Entry::getKey)
                .sorted()
                .findFirst()
                .orElse(null);
    }

    @Override
    public String toString() {
        return "XmlObjectType[" + name + "]";
    }

    /// Collects settings and fields; [#build()] resolves inheritance and schema fields.
    public static final class Builder {

        private final String name;
        private String rootName;
        private String rootNamespace;
        private final Map<String, String> namespaces = new HashMap<>();
        private String xsdSchema;
        private Boolean schemaValidate;
        private XmlObjectFactory factory;
        private final List<XmlObjectType> parents = new ArrayList<>();
        private final Map<String, FieldDeclaration> declared = new LinkedHashMap<>();

        // own settings, applied over inherited ones at build time
        private String ownRootName;
        private String ownRootNamespace;
        private final Map<String, String> ownNamespaces = new HashMap<>();
        private String ownXsdSchema;
        private Boolean ownSchemaValidate;
        private XmlObjectFactory ownFactory;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        public Builder rootName(String rootName) {
            this.ownRootName = rootName;
            return this;
        }

        public Builder rootNamespace(String rootNamespace) {
            this.ownRootNamespace = rootNamespace;
            return this;
        }

        public Builder namespace(String prefix, String uri) {
            Objects.requireNonNull(prefix, "prefix must not be null");
            Objects.requireNonNull(uri, "uri must not be null");
            ownNamespaces.put(prefix, uri);
            return this;
        }

        public Builder xsdSchema(String location) {
            this.ownXsdSchema = location;
            return this;
        }

        public Builder schemaValidate(boolean schemaValidate) {
            this.ownSchemaValidate = schemaValidate;
            return this;
        }

        public Builder factory(XmlObjectFactory factory) {
            this.ownFactory = Objects.requireNonNull(factory, "factory must not be null");
            return this;
        }

        /// Inherits fields and settings; call order matters, later parents win.
        public Builder extend(XmlObjectType... types) {
            for (final var type : types) {
                parents.add(Objects.requireNonNull(type, "parent type must not be null"));
            }
            return this;
        }

        /// Declares a field; redeclaring a name replaces the earlier declaration.
        public Builder field(String fieldName, FieldDeclaration declaration) {
            Objects.requireNonNull(fieldName, "fieldName must not be null");
            Objects.requireNonNull(declaration, "declaration must not be null");
            declared.put(fieldName, declaration);
            return this;
        }

        /// @throws XmlMappingException if a schema field cannot be resolved
        public XmlObjectType build() {
            final var merged = new HashMap<String, XmlField<?, ?>>();
            for (final var parent : parents) {
                inherit(parent);
                merged.putAll(parent.fields);
            }
            applyOwnSettings();

            final var own = new HashMap<String, XmlField<?, ?>>();
            XsdSchema schema = null;
            for (final var entry : declared.entrySet()) {
                final var declaration = entry.getValue();
                if (declaration instanceof SchemaField schemaField) {
                    if (schema == null) {
                        schema = loadSchema(entry.getKey());
                    }
                    own.put(entry.getKey(), schemaField.resolve(schema));
                } else {
                    own.put(entry.getKey(), (XmlField<?, ?>) declaration);
                }
            }
            merged.putAll(own);

            final var ordered = new ArrayList<>(merged.entrySet());
            ordered.sort(Comparator.comparingLong(e -> e.getValue().creationCounter()));
            final var fields = new LinkedHashMap<String, XmlField<?, ?>>();
            ordered.forEach(e -> fields.put(e.getKey(), e.getValue()));

            final var type = new XmlObjectType(this, fields);
            // self references can only be bound once the type exists
            own.values().forEach(field -> {
                if (field.mapper() instanceof XmlMapper.NodeMapper nodeMapper
                        && nodeMapper.isSelfReference() && !nodeMapper.isBound()) {
                    nodeMapper.bind(type);
                }
            });
            LOG.fine(() -> "Built type " + name + " with fields " + fields.keySet());
            return type;
        }

        private void inherit(XmlObjectType parent) {
            if (parent.rootName != null) {
                rootName = parent.rootName;
            }
            if (parent.rootNamespace != null) {
                rootNamespace = parent.rootNamespace;
            }
            namespaces.putAll(parent.namespaces);
            if (parent.xsdSchema != null) {
                xsdSchema = parent.xsdSchema;
            }
            schemaValidate = parent.schemaValidate;
            factory = parent.factory;
        }

        private void applyOwnSettings() {
            if (ownRootName != null) {
                rootName = ownRootName;
            }
            if (ownRootNamespace != null) {
                rootNamespace = ownRootNamespace;
            }
            namespaces.putAll(ownNamespaces);
            if (ownXsdSchema != null) {
                xsdSchema = ownXsdSchema;
            }
            if (ownSchemaValidate != null) {
                schemaValidate = ownSchemaValidate;
            }
            if (ownFactory != null) {
                factory = ownFactory;
            }
        }

        private XsdSchema loadSchema(String fieldName) {
            if (xsdSchema == null) {
                throw new XmlMappingException("Schema field '" + fieldName + "' on " + name
                        + " needs an XSD schema location on the type or a parent");
            }
            return XsdSchema.load(xsdSchema);
        }
    }
}
