/**
 * Qualified names and the matching used by element lookup.
 */
package org.treedom.name;
