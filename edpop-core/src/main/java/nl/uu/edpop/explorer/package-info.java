/**
 * Catalog reader contract: the {@link nl.uu.edpop.explorer.Reader} pagination engine, the
 * {@link nl.uu.edpop.explorer.Catalog} descriptor and the reader exceptions.
 */
package nl.uu.edpop.explorer;
