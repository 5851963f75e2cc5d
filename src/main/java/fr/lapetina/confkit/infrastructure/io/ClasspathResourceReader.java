package fr.lapetina.confkit.infrastructure.io;

import fr.lapetina.confkit.exception.StructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Reads resources from a class loader. A leading {@code /} in the path is ignored.
 */
public final class ClasspathResourceReader implements ResourceReader {

    private static final Logger log = LoggerFactory.getLogger(ClasspathResourceReader.class);

    private final ClassLoader classLoader;

    public ClasspathResourceReader(ClassLoader classLoader) {
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
    }

    public ClasspathResourceReader() {
        this(defaultClassLoader());
    }

    @Override
    public byte[] read(String path) {
        Objects.requireNonNull(path, "path");
        String resource = path.startsWith("/") ? path.substring(1) : path;

        try (InputStream is = classLoader.getResourceAsStream(resource)) {
            if (is == null) {
                throw new StructureException("Resource not found on classpath: " + resource);
            }
            byte[] bytes = is.readAllBytes();
            log.debug("Read {} bytes from classpath resource {}", bytes.length, resource);
            return bytes;
        } catch (IOException e) {
            throw new StructureException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static ClassLoader defaultClassLoader() {
        ClassLoader context = Thread.currentThread().getContextClassLoader();
        return context != null ? context : ClasspathResourceReader.class.getClassLoader();
    }
}
