/**
 * Jackson streaming helpers shared by the NDJSON adapters.
 */
package org.cellpainting.loaddata.infrastructure.json;
