/**
 * Logging bootstrap helpers for the CLI.
 */
package org.cellpainting.loaddata.logging;
