import config.ServerConfig;
import lombok.extern.slf4j.Slf4j;
import server.RedisServer;

/**
 * Redis 서버 애플리케이션의 진입점
 */
@Slf4j
public class Main {

    public static void main(String[] args) throws Exception {
        // 서버 설정 생성 후 명령행 인수로 오버라이드
        ServerConfig config = new ServerConfig();
        config.parseCommandLineArgs(args);

        if (!config.isEnabled() || !config.isAutoStart()) {
            log.info("Embedded Redis server is disabled or auto-start is off; not starting");
            return;
        }

        RedisServer server = new RedisServer(config.getSweepIntervalMillis());
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "redis-shutdown"));
        server.start(config.getHost(), config.getPort());
        Thread.currentThread().join();
    }
}
