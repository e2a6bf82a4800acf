package net.layerline.adapter.jdbc;

import java.sql.Connection;

/** 현재 스레드에 묶인 트랜잭션 커넥션 */
public final class TxContext {
    private static final ThreadLocal<Connection> LOCAL = new ThreadLocal<>();
    private TxContext() {}
    public static void set(Connection c) { LOCAL.set(c); }
    public static Connection get() { return LOCAL.get(); }
    public static void clear() { LOCAL.remove(); }

    /** 리포지토리는 이 커넥션만 쓴다 */
    public static Connection required() {
        Connection c = LOCAL.get();
        if (c == null) throw new IllegalStateException("TxContext required (wrap with a TxRunner)");
        return c;
    }
}
