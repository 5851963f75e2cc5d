/**
 * Value types shared by the merge and update code.
 */
package fr.lapetina.confkit.domain.model;
