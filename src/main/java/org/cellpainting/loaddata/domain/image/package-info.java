/**
 * Image records, correction artifacts, and the channel and file-name rules that connect them.
 */
package org.cellpainting.loaddata.domain.image;
