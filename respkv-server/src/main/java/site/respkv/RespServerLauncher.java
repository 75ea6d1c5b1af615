package site.respkv;

import lombok.extern.slf4j.Slf4j;
import site.respkv.server.RespMiniServer;
import site.respkv.server.RespServer;
import site.respkv.server.config.RespServerConfig;

/**
 * 启动入口：{@code RespServerLauncher [host] [port]}
 */
@Slf4j
public class RespServerLauncher {

    public static void main(final String[] args) {
        final RespServerConfig config = parseArgs(args);

        final RespServer server = new RespMiniServer(config);
        server.start();
        log.info("服务器在{}上启动，端口为{}", config.getHost(), server.getBoundPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.stop();
            } catch (RuntimeException e) {
                log.error("关闭服务器时发生错误", e);
            }
        }, "respkv-shutdown"));
    }

    static RespServerConfig parseArgs(final String[] args) {
        final RespServerConfig config = RespServerConfig.defaultConfig();
        if (args.length > 0) {
            config.setHost(args[0]);
        }
        if (args.length > 1) {
            try {
                config.setPort(Integer.parseInt(args[1]));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("端口号不是整数: " + args[1], e);
            }
        }
        config.validate();
        return config;
    }
}
