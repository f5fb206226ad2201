/**
 * Load-data manifest model, synthesis and concatenation.
 */
package org.cellpainting.loaddata.domain.manifest;
