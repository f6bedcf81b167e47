package org.gc.freegames.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneOffset;

@Data
@Configuration
@ConfigurationProperties(prefix = "free-games")
public class FreeGamesProperties {

    private Store store = new Store();
    private Scheduler scheduler = new Scheduler();
    private Provider provider = new Provider();
    private Proxy proxy = new Proxy();
    private Transport transport = new Transport();

    @Data
    public static class Store {
        private String dataDir = "data";
        private String subscriptionsFile = "subscriptions.json";
        private String scheduleFile = "scheduler.json";
        private String pushHistoryFile = "push_history.json";

        public Path resolve(String fileName) {
            return Path.of(dataDir).resolve(fileName);
        }
    }

    @Data
    public static class Scheduler {
        /** Offset every delivery time is expressed in, independent of the host timezone. */
        private String referenceZone = "+08:00";
        private Duration tickInterval = Duration.ofSeconds(60);
        private boolean restoreOnStartup = true;
        private String jobIdPrefix = "epic";

        public ZoneOffset referenceOffset() {
            return ZoneOffset.of(referenceZone);
        }
    }

    @Data
    public static class Provider {
        private String baseUrl = "https://store-site-backend-static-ipv4.ak.epicgames.com";
        private String path = "/freeGamesPromotions";
        private String locale = "zh-CN";
        private String country = "CN";
        private String storeUrl = "https://store.epicgames.com";
        private Duration timeout = Duration.ofSeconds(15);
    }

    @Data
    public static class Proxy {
        /** Empty for a direct connection, otherwise {@code http} or {@code socks5}. */
        private String type = "";
        private String host = "127.0.0.1";
        private int port = 7890;
        private String username = "";
        private String password = "";
    }

    @Data
    public static class Transport {
        private String baseUrl = "http://127.0.0.1:3000";
        private String accessToken = "";
        private Duration timeout = Duration.ofSeconds(15);
        private String nickname = "EpicGameStore";
        private String senderId = "2854196320";
    }
}
