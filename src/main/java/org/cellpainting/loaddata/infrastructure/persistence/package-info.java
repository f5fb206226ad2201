/**
 * File-backed adapters for manifests and handoff units. All writes are atomic renames of a temporary sibling.
 */
package org.cellpainting.loaddata.infrastructure.persistence;
