/**
 * Authentication header encryption.
 *
 * @see com.sharedsource.webapi.security.SecurityUtil
 */
package com.sharedsource.webapi.security;
