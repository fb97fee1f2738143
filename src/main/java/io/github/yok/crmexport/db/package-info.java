/**
 * Local relational store: schema creation, idempotent record upserts and association edges.
 */
package io.github.yok.crmexport.db;
