/**
 * The capability interfaces of the tree: one per node kind on top of {@link org.treedom.api.Node}.
 */
package org.treedom.api;
