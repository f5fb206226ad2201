/**
 * Input adapters delivering image and correction streams.
 */
package org.cellpainting.loaddata.infrastructure.source;
