/**
 * Credentials sent by authenticated data contexts.
 */
package com.sharedsource.webapi.credentials;
