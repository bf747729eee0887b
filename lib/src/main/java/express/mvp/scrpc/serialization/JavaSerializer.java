package express.mvp.scrpc.serialization;

import edu.umd.cs.findbugs.annotations.CheckForNull;
import express.mvp.scrpc.error.MarshalingException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.ObjectStreamClass;
import java.util.Objects;

/**
 * {@link Serializer} based on Java object serialization.
 *
 * <p>Every argument, return value and exception must implement {@link java.io.Serializable}.
 * Argument arrays ({@code Object[]}) round-trip as arrays, so the server can tell them apart from
 * any other value.
 *
 * <p>Deserialization resolves classes through the given class loader, falling back to the default
 * resolution of {@link ObjectInputStream}. Only peers that are trusted should be connected: Java
 * deserialization of untrusted input is unsafe.
 */
public final class JavaSerializer implements Serializer {

    private static final JavaSerializer INSTANCE = new JavaSerializer(null);

    @CheckForNull private final ClassLoader classLoader;

    /**
     * Creates a serializer resolving classes through {@code classLoader}.
     *
     * @param classLoader the loader for deserialized classes, or null for the default lookup
     */
    public JavaSerializer(@CheckForNull ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    /**
     * Returns the shared instance using default class resolution.
     *
     * @return the default serializer
     */
    public static JavaSerializer getInstance() {
        return INSTANCE;
    }

    @Override
    public byte[] serialize(@CheckForNull Object value) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(value);
        } catch (IOException e) {
            throw new MarshalingException("Cannot serialize " + describe(value), e);
        }
        return bytes.toByteArray();
    }

    @Override
    @CheckForNull
    public Object deserialize(byte[] data) {
        Objects.requireNonNull(data, "data must not be null");
        try (ObjectInputStream in = new LoaderAwareInputStream(new ByteArrayInputStream(data))) {
            return in.readObject();
        } catch (IOException | ClassNotFoundException | RuntimeException e) {
            throw new MarshalingException("Cannot deserialize " + data.length + " bytes", e);
        }
    }

    private static String describe(@CheckForNull Object value) {
        return value == null ? "null" : value.getClass().getName();
    }

    private final class LoaderAwareInputStream extends ObjectInputStream {

        LoaderAwareInputStream(InputStream in) throws IOException {
            super(in);
        }

        @Override
        protected Class<?> resolveClass(ObjectStreamClass desc)
                throws IOException, ClassNotFoundException {
            if (classLoader != null) {
                try {
                    return Class.forName(desc.getName(), false, classLoader);
                } catch (ClassNotFoundException e) {
                    // primitives and arrays of primitives go through the default path
                    return super.resolveClass(desc);
                }
            }
            return super.resolveClass(desc);
        }
    }
}
