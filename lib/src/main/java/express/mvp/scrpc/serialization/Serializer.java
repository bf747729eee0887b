package express.mvp.scrpc.serialization;

import edu.umd.cs.findbugs.annotations.CheckForNull;
import express.mvp.scrpc.error.MarshalingException;

/**
 * Converts call arguments, return values and exceptions to and from bytes.
 *
 * <p>Client and server must use compatible implementations. {@link JavaSerializer} is the default.
 * Implementations must be thread-safe; one instance is shared by every worker of a server.
 */
public interface Serializer {

    /**
     * Serializes a value.
     *
     * @param value the value, may be null
     * @return the serialized bytes
     * @throws MarshalingException if the value cannot be serialized
     */
    byte[] serialize(@CheckForNull Object value);

    /**
     * Deserializes a value.
     *
     * @param data bytes produced by {@link #serialize(Object)}
     * @return the value, may be null
     * @throws MarshalingException if the bytes are malformed or name an unknown class
     */
    @CheckForNull
    Object deserialize(byte[] data);

    /**
     * Serializes an exception for an {@code EXCEPTION} frame.
     *
     * <p>If {@code failure} cannot be serialized, a {@link RemoteInvocationFailure} carrying its
     * class name, message and stack trace is serialized instead.
     *
     * @param failure the exception raised on the server
     * @return the serialized bytes
     * @throws MarshalingException if even the replacement cannot be serialized
     */
    default byte[] serializeFailure(Throwable failure) {
        try {
            return serialize(failure);
        } catch (MarshalingException e) {
            return serialize(new RemoteInvocationFailure(failure));
        }
    }
}
