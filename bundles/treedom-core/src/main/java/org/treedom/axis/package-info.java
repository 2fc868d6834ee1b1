/**
 * Axes to traverse trees.
 */
package org.treedom.axis;
