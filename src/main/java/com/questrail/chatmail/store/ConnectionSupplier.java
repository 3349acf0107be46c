package com.questrail.chatmail.store;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of JDBC connections. Each call returns a connection the caller closes.
 */
@FunctionalInterface
public interface ConnectionSupplier {

    Connection open() throws SQLException;
}
