/**
 * dBase import package.
 *
 * <p>
 * Reads a DBF file and loads its records into a relational table, created from the DBF field
 * definitions when it does not exist.
 * </p>
 */
package io.github.yok.dataporter.dbfimport;
