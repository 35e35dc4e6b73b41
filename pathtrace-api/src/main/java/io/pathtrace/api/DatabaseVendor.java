/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.pathtrace.api;

/**
 * Vendor names of well-known databases.
 */
public final class DatabaseVendor {

    public static final String APACHE_HIVE = "ApacheHive";
    /**
     * Apache Derby, also known as IBM Cloudscape
     */
    public static final String CLOUDSCAPE = "Cloudscape";
    public static final String HSQLDB = "HSQLDB";
    public static final String PROGRESS = "Progress";
    public static final String MAXDB = "MaxDB";
    public static final String HANADB = "HanaDB";
    public static final String INGRES = "Ingres";
    public static final String FIRST_SQL = "FirstSQL";
    public static final String ENTERPRISE_DB = "EnterpriseDB";
    public static final String CACHE = "Cache";
    public static final String ADABAS = "Adabas";
    public static final String FIREBIRD = "Firebird";
    public static final String DB2 = "DB2";
    public static final String DERBY_CLIENT = "Derby Client";
    public static final String DERBY_EMBEDDED = "Derby Embedded";
    public static final String FILEMAKER = "Filemaker";
    public static final String INFORMIX = "Informix";
    public static final String INSTANT_DB = "InstantDb";
    public static final String INTERBASE = "Interbase";
    public static final String MYSQL = "MySQL";
    public static final String MARIADB = "MariaDB";
    public static final String NETEZZA = "Netezza";
    public static final String ORACLE = "Oracle";
    public static final String PERVASIVE = "Pervasive";
    public static final String POINTBASE = "Pointbase";
    public static final String POSTGRESQL = "PostgreSQL";
    public static final String SQLSERVER = "SQL Server";
    public static final String SQLITE = "sqlite";
    public static final String SYBASE = "Sybase";
    public static final String TERADATA = "Teradata";
    public static final String VERTICA = "Vertica";
    public static final String CASSANDRA = "Cassandra";
    public static final String H2 = "H2";
    public static final String COLDFUSION_IMQ = "ColdFusion IMQ";
    public static final String REDSHIFT = "Amazon Redshift";

    private DatabaseVendor() {
    }
}
