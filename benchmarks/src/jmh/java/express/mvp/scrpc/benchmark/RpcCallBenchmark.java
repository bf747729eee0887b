package express.mvp.scrpc.benchmark;

import express.mvp.scrpc.client.RpcProxy;
import express.mvp.scrpc.server.FunctionRegistry;
import express.mvp.scrpc.server.RpcServer;
import express.mvp.scrpc.server.RpcServerConfig;
import org.openjdk.jmh.annotations.*;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Latency of a complete remote call: {@code PERFORM}, two acknowledgements, the arguments and the
 * result, each its own frame, plus Java serialization on both ends.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.SampleTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(1)
@Warmup(iterations = 1, time = 10)
@Measurement(iterations = 1, time = 30)
public class RpcCallBenchmark {

    @Param({ "0", "1024", "65536" })
    private int payloadSize;

    private RpcServer server;
    private RpcProxy proxy;
    private byte[] payload;

    @Setup
    public void setup() throws Exception {
        payload = new byte[payloadSize];
        new Random(42).nextBytes(payload);

        FunctionRegistry registry = new FunctionRegistry();
        registry.register("add", args -> (Integer) args[0] + (Integer) args[1]);
        registry.register("echo", args -> args[0]);

        server = new RpcServer(RpcServerConfig.builder().host("127.0.0.1").build(), registry);
        server.start();
        if (!server.awaitReady(Duration.ofSeconds(10))) {
            throw new IllegalStateException("Server did not start");
        }
        proxy = new RpcProxy(server.getAddress());
    }

    @TearDown
    public void tearDown() {
        if (proxy != null) {
            proxy.close();
        }
        if (server != null) {
            server.close();
        }
    }

    @Benchmark
    public Object add() {
        return proxy.call("add", 2, 3);
    }

    @Benchmark
    public Object echo() {
        return proxy.call("echo", (Object) payload);
    }
}
