package com.simhub.server;

import com.simhub.GatewayApplication;
import com.simhub.codec.PayloadDecoder;
import com.simhub.config.AppSettings;
import com.simhub.service.TelemetryService;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Главный класс приложения. Запускает HTTP-сервер на Netty.
 * <p>
 * Обработка запроса синхронно пишет в БД, поэтому обработчик вынесен
 * в отдельную группу потоков и не блокирует event loop.
 */
public class HttpServer {

  private static final Logger logger = LoggerFactory.getLogger(HttpServer.class);

  private static final int MAX_CONTENT_LENGTH = 65536;
  private static final int HANDLER_THREADS = 4;

  private final int port;
  private final PayloadDecoder payloadDecoder;
  private final TelemetryService telemetryService;

  /**
   * Конструктор HTTP-сервера.
   *
   * @param port Порт, на котором будет работать сервер.
   * @param payloadDecoder Декодер входящих сообщений.
   * @param telemetryService Сервис обработки сообщений.
   */
  public HttpServer(int port, PayloadDecoder payloadDecoder, TelemetryService telemetryService) {
    this.port = port;
    this.payloadDecoder = payloadDecoder;
    this.telemetryService = telemetryService;
  }

  /**
   * Запускает сервер и ожидает завершения.
   *
   * @throws Exception если произошла ошибка при запуске.
   */
  public void start() throws Exception {
    EventLoopGroup bossGroup = new NioEventLoopGroup(1);
    EventLoopGroup workerGroup = new NioEventLoopGroup();
    EventExecutorGroup handlerGroup = new DefaultEventExecutorGroup(HANDLER_THREADS);
    try {
      ServerBootstrap b = new ServerBootstrap();
      b.group(bossGroup, workerGroup)
          .channel(NioServerSocketChannel.class)
          .childHandler(new ChannelInitializer<SocketChannel>() {
            @Override
            public void initChannel(SocketChannel ch) {
              ch.pipeline()
                  .addLast(new HttpServerCodec())
                  .addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH))
                  .addLast(handlerGroup, new HttpServerHandler(payloadDecoder, telemetryService));
            }
          })
          .option(ChannelOption.SO_BACKLOG, 128)
          .childOption(ChannelOption.SO_KEEPALIVE, true);

      ChannelFuture f = b.bind(port).sync();
      logger.info("🚀 Сервер запущен на http://localhost:{}", port);
      f.channel().closeFuture().sync();
    } finally {
      handlerGroup.shutdownGracefully();
      workerGroup.shutdownGracefully();
      bossGroup.shutdownGracefully();
    }
  }

  /**
   * Точка входа в приложение.
   * Поднимает БД из снимка, запускает фоновые задачи и HTTP-сервер.
   *
   * @param args Аргументы командной строки (не используются).
   * @throws Exception если произошла ошибка при запуске.
   */
  public static void main(String[] args) throws Exception {
    AppSettings settings = AppSettings.load();
    GatewayApplication application = GatewayApplication.create(settings);
    Runtime.getRuntime().addShutdownHook(new Thread(application::close, "shutdown"));
    application.startBackgroundTasks();
    new HttpServer(settings.getPort(), application.getPayloadDecoder(), application.getTelemetryService()).start();
  }
}
