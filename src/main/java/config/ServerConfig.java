package config;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * 내장 Redis 서버 설정을 관리하는 클래스
 * 서버 코어는 이 값들이 어디서 왔는지 알지 못하며, start(host, port) 로만 전달받습니다.
 */
@Slf4j
@Getter
@Setter
public class ServerConfig {
    private boolean enabled = true;
    private int port = 6379;
    private String host = "localhost";
    private boolean autoStart = true;
    private long sweepIntervalMillis = 100L;

    /**
     * 명령행 인수를 파싱하여 설정을 업데이트합니다.
     */
    public void parseCommandLineArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--port":
                    if (i + 1 < args.length) {
                        String value = args[++i];
                        try {
                            this.port = Integer.parseInt(value);
                            log.info("명령행에서 포트 설정: {}", this.port);
                        } catch (NumberFormatException e) {
                            log.warn("잘못된 포트 번호: {}", value);
                        }
                    }
                    break;
                case "--host":
                case "--bind":
                    if (i + 1 < args.length) {
                        this.host = args[++i];
                        log.info("명령행에서 바인드 주소 설정: {}", this.host);
                    }
                    break;
                case "--enabled":
                    if (i + 1 < args.length) {
                        this.enabled = Boolean.parseBoolean(args[++i]);
                    }
                    break;
                case "--auto-start":
                    if (i + 1 < args.length) {
                        this.autoStart = Boolean.parseBoolean(args[++i]);
                    }
                    break;
                case "--sweep-interval":
                    if (i + 1 < args.length) {
                        String value = args[++i];
                        try {
                            long interval = Long.parseLong(value);
                            if (interval > 0) {
                                this.sweepIntervalMillis = interval;
                            } else {
                                log.warn("sweep 주기는 양수여야 합니다: {}", value);
                            }
                        } catch (NumberFormatException e) {
                            log.warn("잘못된 sweep 주기: {}", value);
                        }
                    }
                    break;
                default:
                    log.warn("알 수 없는 옵션 무시: {}", args[i]);
            }
        }
    }
}
