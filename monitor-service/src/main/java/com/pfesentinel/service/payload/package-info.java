/**
 * JSON request bodies accepted by the monitor service.
 */
package com.pfesentinel.service.payload;
