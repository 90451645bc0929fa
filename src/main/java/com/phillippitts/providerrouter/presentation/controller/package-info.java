/**
 * REST admin endpoints under {@code /api/routing}.
 */
package com.phillippitts.providerrouter.presentation.controller;
