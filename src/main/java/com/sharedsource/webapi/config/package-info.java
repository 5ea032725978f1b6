/**
 * Configuration foundation and data context configuration.
 *
 * <p>Files are JSON5 and read leniently with Gson.
 * <br><b>Example:</b>
 * <pre>DataContext context = DataContextFactory.createFromFile("cfg/context.json5");</pre>
 */
package com.sharedsource.webapi.config;
