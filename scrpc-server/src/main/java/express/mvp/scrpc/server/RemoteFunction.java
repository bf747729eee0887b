package express.mvp.scrpc.server;

/**
 * A function that remote clients may call by name.
 *
 * <p>Arguments arrive exactly as the client passed them, positionally. Any exception thrown is
 * serialized and sent back to the caller; the connection stays open.
 */
@FunctionalInterface
public interface RemoteFunction {

    /**
     * Invokes the function.
     *
     * @param args the deserialized positional arguments, never null
     * @return the result to serialize back to the caller, may be null
     * @throws Exception any failure, delivered to the caller as a remote exception
     */
    Object invoke(Object... args) throws Exception;
}
