/**
 * Kind-specific state of nodes, one delegate per extension variant.
 */
package org.treedom.node.delegates;
