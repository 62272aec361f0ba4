package io.recovery.testing;

import io.recovery.spi.ConnectionProvider;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Connections that do nothing, for stores that ignore the connection they are given.
 */
public final class FakeConnections {

    private FakeConnections() {
    }

    public static Connection connection() {
        boolean[] autoCommit = {true};
        return (Connection) Proxy.newProxyInstance(
                FakeConnections.class.getClassLoader(),
                new Class<?>[]{Connection.class},
                (proxy, method, args) -> switch (method.getName()) {
                    case "getAutoCommit" -> autoCommit[0];
                    case "setAutoCommit" -> {
                        autoCommit[0] = (Boolean) args[0];
                        yield null;
                    }
                    case "isClosed", "isReadOnly" -> false;
                    case "isValid" -> true;
                    case "hashCode" -> System.identityHashCode(proxy);
                    case "equals" -> proxy == args[0];
                    case "toString" -> "FakeConnection";
                    default -> null;
                });
    }

    public static ConnectionProvider provider() {
        return FakeConnections::connection;
    }

    /**
     * Provider that fails every request, counting the attempts.
     */
    public static ConnectionProvider failing(AtomicInteger attempts) {
        return () -> {
            attempts.incrementAndGet();
            throw new SQLException("connection refused");
        };
    }
}
