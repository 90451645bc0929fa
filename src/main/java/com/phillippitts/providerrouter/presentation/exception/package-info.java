/**
 * Maps routing exceptions to HTTP responses.
 */
package com.phillippitts.providerrouter.presentation.exception;
