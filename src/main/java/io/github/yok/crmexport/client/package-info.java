/**
 * HTTP access to the CRM REST API.
 *
 * <p>
 * {@link io.github.yok.crmexport.client.CrmTransportClient} sends requests with timeouts and
 * fixed-delay retries; {@link io.github.yok.crmexport.client.CrmApiClient} maps the endpoints used
 * by the export onto typed calls.
 * </p>
 */
package io.github.yok.crmexport.client;
