package server.server;

/**
 * 游戏网关服务端
 */
public interface GameServer {

    /**
     * 绑定端口并开始接受连接，绑定完成后立即返回
     *
     * @param port 监听端口，0 表示由系统分配
     * @throws InterruptedException 等待绑定时被中断
     */
    void start(int port) throws InterruptedException;

    /**
     * 停止接受连接，关闭现有连接并等待正在执行的处理器完成
     */
    void stop();
}
