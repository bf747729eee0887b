package express.mvp.scrpc.benchmark;

import express.mvp.scrpc.transport.FramedTransport;
import express.mvp.scrpc.transport.TransportConfig;
import express.mvp.scrpc.transport.TransportException;
import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import org.openjdk.jmh.annotations.*;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Round trip of one length-prefixed frame through an echo peer.
 *
 * <p>Compares {@link FramedTransport} with the same framing built from Netty's length field
 * codecs.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.SampleTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(1)
@Warmup(iterations = 1, time = 10)
@Measurement(iterations = 1, time = 30)
public class FramedEchoBenchmark {

    @Param({ "SCRPC", "NETTY" })
    private String implementation;

    @Param({ "64", "4096", "65536" })
    private int payloadSize;

    private BenchmarkDriver driver;

    @Setup
    public void setup() throws Exception {
        byte[] payload = new byte[payloadSize];
        new Random(42).nextBytes(payload);

        switch (implementation) {
            case "SCRPC" -> driver = new ScrpcDriver(payload);
            case "NETTY" -> driver = new NettyDriver(payload);
            default -> throw new IllegalArgumentException("Unknown implementation: " + implementation);
        }
        driver.setup();
    }

    @TearDown
    public void tearDown() {
        if (driver != null) {
            driver.tearDown();
        }
    }

    @Benchmark
    public Object echo() throws Exception {
        return driver.echo();
    }

    interface BenchmarkDriver {
        void setup() throws Exception;

        Object echo() throws Exception;

        void tearDown();
    }

    // ==========================================
    // SCRPC framed transport
    // ==========================================
    static class ScrpcDriver implements BenchmarkDriver {
        private final byte[] payload;
        private FramedTransport listener;
        private FramedTransport client;
        private Thread serverThread;
        private volatile boolean running = true;

        ScrpcDriver(byte[] payload) {
            this.payload = payload;
        }

        @Override
        public void setup() throws Exception {
            TransportConfig config = TransportConfig.defaults();
            listener = FramedTransport.listen(
                    new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 1, config);
            CountDownLatch serverStarted = new CountDownLatch(1);

            serverThread = new Thread(() -> {
                try (FramedTransport peer = listener.accept(Duration.ofSeconds(10))) {
                    serverStarted.countDown();
                    byte[] frame;
                    while ((frame = peer.recvFramed(Duration.ofSeconds(60))) != null) {
                        peer.sendFramed(frame);
                    }
                } catch (TransportException e) {
                    if (running)
                        e.printStackTrace();
                }
            }, "echo-server");
            serverThread.setDaemon(true);
            serverThread.start();

            client = FramedTransport.open(config);
            client.connect(listener.localAddress());
            serverStarted.await();
        }

        @Override
        public Object echo() {
            client.sendFramed(payload);
            return client.recvFramed();
        }

        @Override
        public void tearDown() {
            running = false;
            client.close();
            listener.close();
            try {
                serverThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // ==========================================
    // Netty length field codecs
    // ==========================================
    static class NettyDriver implements BenchmarkDriver {
        private final ByteBuf msg;
        private final int maxFrameLength;
        private EventLoopGroup bossGroup;
        private EventLoopGroup workerGroup;
        private EventLoopGroup clientGroup;
        private Channel serverChannel;
        private Channel clientChannel;
        private volatile CountDownLatch latch;

        NettyDriver(byte[] payload) {
            this.msg = Unpooled.directBuffer(payload.length).writeBytes(payload);
            this.maxFrameLength = Math.max(payload.length, 1) * 2;
        }

        @Override
        public void setup() throws Exception {
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup(1);
            clientGroup = new NioEventLoopGroup(1);

            ServerBootstrap sb = new ServerBootstrap();
            sb.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline()
                                    .addLast(new LengthFieldBasedFrameDecoder(maxFrameLength, 0, 4, 0, 4))
                                    .addLast(new LengthFieldPrepender(4))
                                    .addLast(new ChannelInboundHandlerAdapter() {
                                        @Override
                                        public void channelRead(ChannelHandlerContext ctx, Object frame) {
                                            ctx.writeAndFlush(frame);
                                        }
                                    });
                        }
                    });

            serverChannel = sb.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0)).sync().channel();

            Bootstrap cb = new Bootstrap();
            cb.group(clientGroup)
                    .channel(NioSocketChannel.class)
                    .option(ChannelOption.TCP_NODELAY, true)
                    .handler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline()
                                    .addLast(new LengthFieldBasedFrameDecoder(maxFrameLength, 0, 4, 0, 4))
                                    .addLast(new LengthFieldPrepender(4))
                                    .addLast(new ChannelInboundHandlerAdapter() {
                                        @Override
                                        public void channelRead(ChannelHandlerContext ctx, Object frame) {
                                            if (frame instanceof ByteBuf) {
                                                ((ByteBuf) frame).release();
                                            }
                                            CountDownLatch current = latch;
                                            if (current != null) {
                                                current.countDown();
                                            }
                                        }
                                    });
                        }
                    });

            clientChannel = cb.connect(serverChannel.localAddress()).sync().channel();
        }

        @Override
        public Object echo() throws Exception {
            CountDownLatch done = new CountDownLatch(1);
            latch = done;
            // write releases, so hand over an independent reference
            clientChannel.writeAndFlush(msg.retainedDuplicate());
            done.await();
            return done;
        }

        @Override
        public void tearDown() {
            try {
                if (clientChannel != null)
                    clientChannel.close().sync();
                if (clientGroup != null)
                    clientGroup.shutdownGracefully().sync();
                if (workerGroup != null)
                    workerGroup.shutdownGracefully().sync();
                if (bossGroup != null)
                    bossGroup.shutdownGracefully().sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                msg.release();
            }
        }
    }
}
