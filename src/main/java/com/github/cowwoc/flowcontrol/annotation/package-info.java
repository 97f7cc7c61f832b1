/**
 * Annotations used to document the API.
 */
package com.github.cowwoc.flowcontrol.annotation;
