package server;

import command.CommandHandler;
import lombok.extern.slf4j.Slf4j;
import storage.StorageManager;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Redis 서버의 메인 클래스
 * 서버 시작/중지와 클라이언트 연결 수락을 담당합니다.
 * 연결마다 하나의 {@link ClientHandler} 작업이 공유 스레드 풀에서 실행됩니다.
 */
@Slf4j
public class RedisServer {

    private final long sweepIntervalMillis;
    private final Object lifecycleLock = new Object();
    private final Set<Socket> clients = ConcurrentHashMap.newKeySet();

    private volatile boolean running;
    private ServerSocket serverSocket;
    private ExecutorService workerPool;
    private StorageManager storageManager;

    public RedisServer() {
        this(StorageManager.DEFAULT_SWEEP_INTERVAL_MILLIS);
    }

    public RedisServer(long sweepIntervalMillis) {
        if (sweepIntervalMillis <= 0) {
            throw new IllegalArgumentException("sweepIntervalMillis must be > 0");
        }
        this.sweepIntervalMillis = sweepIntervalMillis;
    }

    /**
     * 주어진 주소에 바인드하고 연결 수락을 시작합니다. 바인드는 호출 스레드에서 끝나므로
     * 이 메서드가 반환되면 바로 접속할 수 있습니다. 이미 실행 중이면 경고만 남깁니다.
     *
     * @throws IOException 바인드에 실패한 경우
     */
    public void start(String host, int port) throws IOException {
        Objects.requireNonNull(host, "host");
        synchronized (lifecycleLock) {
            if (running) {
                log.warn("Redis server already running on {}; ignoring start({}:{})",
                        serverSocket.getLocalSocketAddress(), host, port);
                return;
            }

            ServerSocket socket = createServerSocket(host, port);
            StorageManager storage = new StorageManager(sweepIntervalMillis);
            storage.startExpirySweeper();
            CommandHandler commandHandler = new CommandHandler(storage);

            this.serverSocket = socket;
            this.storageManager = storage;
            ExecutorService pool = Executors.newCachedThreadPool(new WorkerThreadFactory());
            this.workerPool = pool;
            this.running = true;
            pool.execute(() -> acceptLoop(socket, commandHandler, pool));
            log.info("Redis server started on {}", socket.getLocalSocketAddress());
        }
    }

    /**
     * 서버 소켓을 생성하고 설정된 주소에만 바인드합니다.
     */
    private ServerSocket createServerSocket(String host, int port) throws IOException {
        ServerSocket socket = new ServerSocket();
        // 서버 재시작 시 'Address already in use' 에러 방지
        socket.setReuseAddress(true);
        try {
            socket.bind(new InetSocketAddress(host, port));
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        return socket;
    }

    private void acceptLoop(ServerSocket socket, CommandHandler commandHandler, ExecutorService pool) {
        while (!socket.isClosed()) {
            Socket clientSocket;
            try {
                clientSocket = socket.accept();
            } catch (IOException e) {
                if (!socket.isClosed()) {
                    log.error("Error accepting client connection", e);
                }
                continue;
            }

            log.debug("Client connected: {}", clientSocket.getRemoteSocketAddress());
            clients.add(clientSocket);
            if (socket.isClosed()) {
                // stop() ran between accept and registration
                clients.remove(clientSocket);
                closeQuietly(clientSocket);
                break;
            }
            try {
                pool.execute(new ClientHandler(clientSocket, commandHandler, () -> clients.remove(clientSocket)));
            } catch (RejectedExecutionException e) {
                // stop() is shutting the pool down
                clients.remove(clientSocket);
                closeQuietly(clientSocket);
            }
        }
        log.debug("Accept loop finished");
    }

    /**
     * 연결 수락과 만료 sweep 을 멈추고 모든 소켓과 저장소를 정리합니다. 여러 번 호출해도 안전합니다.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            log.info("Shutting down Redis server on {}", serverSocket.getLocalSocketAddress());

            closeQuietly(serverSocket);
            for (Socket client : clients) {
                closeQuietly(client);
            }
            clients.clear();
            workerPool.shutdownNow();
            storageManager.shutdown();

            serverSocket = null;
            workerPool = null;
            storageManager = null;
            log.info("Redis server stopped");
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * 실제로 바인드된 포트. 실행 중이 아니면 -1.
     */
    public int getPort() {
        synchronized (lifecycleLock) {
            return running ? serverSocket.getLocalPort() : -1;
        }
    }

    private static void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            log.debug("Error while closing {}: {}", closeable, e.getMessage());
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "redis-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
