package org.pragmatica.edn;

import org.pragmatica.edn.path.KeyPath;
import org.pragmatica.edn.path.Location;
import org.pragmatica.edn.path.PathResolver;
import org.pragmatica.edn.reader.EdnReader;
import org.pragmatica.edn.reader.ReadResult;
import org.pragmatica.edn.tree.CstNode;
import org.pragmatica.edn.tree.Cursor;
import org.pragmatica.edn.tree.Navigation;
import org.pragmatica.edn.tree.Nodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Entry point for locating key paths in EDN documents.
 *
 * <p>Example usage:
 * <pre>{@code
 * var locator = EdnLocator.create();
 *
 * locator.locate(KeyPath.parse("[:cljsbuild :builds 0]"), Path.of("project.clj"))
 *        .ifPresent(location -> System.out.println(location + " " + location.value()));
 * }</pre>
 *
 * <p>Every {@code locate} call reads and parses its document afresh; the locator itself holds no
 * state besides its configuration and is safe to share between threads.
 */
public final class EdnLocator {
    private static final Logger LOG = LoggerFactory.getLogger(EdnLocator.class);

    private final LocatorConfig config;
    private final PathResolver resolver;

    private EdnLocator(LocatorConfig config) {
        this.config = config;
        this.resolver = PathResolver.create(config.callFormHead());
    }

    public static EdnLocator create() {
        return create(LocatorConfig.DEFAULT);
    }

    public static EdnLocator create(LocatorConfig config) {
        return new EdnLocator(config);
    }

    public static Builder builder() {
        return new Builder();
    }

    public LocatorConfig config() {
        return config;
    }

    public PathResolver resolver() {
        return resolver;
    }

    /**
     * Locate {@code path} in the document stored in {@code file}.
     * Empty if the file does not exist or cannot be read, cannot be parsed, or the path does not resolve.
     */
    public Optional<Location> locate(KeyPath path, Path file) {
        if (!Files.isRegularFile(file)) {
            LOG.debug("No document at {}", file);
            return Optional.empty();
        }
        String text;
        try {
            text = Files.readString(file, config.charset());
        } catch (IOException e) {
            LOG.warn("Cannot read {}: {}", file, e.getMessage());
            return Optional.empty();
        }
        return locate(path, text, file.toString());
    }

    /**
     * Locate {@code path} in already loaded document text; {@code file} only identifies the document.
     */
    public Optional<Location> locate(KeyPath path, String text, String file) {
        var result = EdnReader.read(text, config.maxInputSize(), config.maxDepth());
        if (result instanceof ReadResult.Failure failure) {
            LOG.warn("Cannot parse {}: {}", file, failure.error().message());
            return Optional.empty();
        }
        return locate(path, result.orElseThrow(), file);
    }

    /**
     * Locate {@code path} in an already parsed document.
     */
    public Optional<Location> locate(KeyPath path, CstNode root, String file) {
        var location = initialPosition(root).flatMap(start -> resolver.resolve(path, start))
                                            .map(resolution -> Location.of(file, path, resolution));
        if (location.isEmpty()) {
            LOG.debug("Path {} not found in {}", path, file);
        }
        return location;
    }

    /**
     * Where resolution starts: the first call form headed by the configured symbol, otherwise the
     * first map, vector or list of the document.
     */
    public Optional<Cursor> initialPosition(CstNode root) {
        var top = Cursor.of(root);
        return Navigation.findFirst(node -> Nodes.isCallForm(node, config.callFormHead()), top)
                         .or(() -> Navigation.findFirst(Nodes::isCollection, top));
    }

    public static final class Builder {
        private String callFormHead = LocatorConfig.DEFAULT.callFormHead();
        private Charset charset = LocatorConfig.DEFAULT.charset();
        private int maxInputSize = LocatorConfig.DEFAULT.maxInputSize();
        private int maxDepth = LocatorConfig.DEFAULT.maxDepth();

        private Builder() {}

        public Builder callFormHead(String head) {
            this.callFormHead = head;
            return this;
        }

        public Builder charset(Charset charset) {
            this.charset = charset;
            return this;
        }

        public Builder maxInputSize(int maxInputSize) {
            this.maxInputSize = maxInputSize;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public EdnLocator build() {
            return create(new LocatorConfig(callFormHead, charset, maxInputSize, maxDepth));
        }
    }
}
