/**
 * Logging support: request correlation values in the Log4j2 ThreadContext.
 *
 * @see com.phillippitts.autorecovery.config.logging.MdcFilter
 */
package com.phillippitts.autorecovery.config.logging;
