/**
 * Request entry point and model class resolution.
 */
package fr.lapetina.inference.gateway.routing;
